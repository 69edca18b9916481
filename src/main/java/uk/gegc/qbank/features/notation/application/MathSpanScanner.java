package uk.gegc.qbank.features.notation.application;

import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.notation.domain.model.MathSpan;
import uk.gegc.qbank.features.notation.domain.model.NotationProblem;
import uk.gegc.qbank.features.notation.domain.model.NotationProblemKind;
import uk.gegc.qbank.features.notation.domain.model.ScanResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Single left-to-right pass over author text that locates {@code $...$} and {@code $$...$$} spans.
 * <p>
 * Outside math a doubled {@code $$} always opens a display span before a single {@code $} is considered.
 * A backslash escapes the following character, so {@code \$} never opens or closes a span.
 * Scanning stops at the first unclosed opener since nothing after it can be attributed reliably.
 */
@Component
public class MathSpanScanner {

    private static final char DOLLAR = '$';
    private static final char BACKSLASH = '\\';

    public ScanResult scan(String text) {
        if (text == null || text.isEmpty()) {
            return new ScanResult(List.of(), List.of());
        }

        List<MathSpan> spans = new ArrayList<>();
        List<NotationProblem> problems = new ArrayList<>();
        int length = text.length();
        int i = 0;

        while (i < length) {
            char c = text.charAt(i);
            if (c == BACKSLASH && i + 1 < length) {
                if (isTargetDelimiter(text.charAt(i + 1))) {
                    problems.add(new NotationProblem(NotationProblemKind.TARGET_DIALECT_PRESENT, i));
                }
                i += 2;
                continue;
            }
            if (c != DOLLAR) {
                i++;
                continue;
            }

            boolean block = i + 1 < length && text.charAt(i + 1) == DOLLAR;
            int close = block ? findBlockClose(text, i + 2, problems) : findInlineClose(text, i + 1);
            if (close < 0) {
                problems.add(new NotationProblem(NotationProblemKind.DELIMITER_IMBALANCE, i));
                break;
            }

            MathSpan span = new MathSpan(i, close + (block ? 2 : 1), block);
            if (text.substring(span.contentStart(), span.contentEnd()).isBlank()) {
                problems.add(new NotationProblem(NotationProblemKind.EMPTY_MATH_SPAN, i));
            }
            spans.add(span);
            i = span.end();
        }

        return new ScanResult(spans, problems);
    }

    private int findInlineClose(String text, int from) {
        int j = from;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == BACKSLASH) {
                j += 2;
                continue;
            }
            if (c == DOLLAR) {
                return j;
            }
            j++;
        }
        return -1;
    }

    private int findBlockClose(String text, int from, List<NotationProblem> problems) {
        int j = from;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == BACKSLASH) {
                j += 2;
                continue;
            }
            if (c == DOLLAR) {
                if (j + 1 < text.length() && text.charAt(j + 1) == DOLLAR) {
                    return j;
                }
                problems.add(new NotationProblem(NotationProblemKind.NESTED_DELIMITER, j));
            }
            j++;
        }
        return -1;
    }

    private boolean isTargetDelimiter(char c) {
        return c == '(' || c == ')' || c == '[' || c == ']';
    }
}
