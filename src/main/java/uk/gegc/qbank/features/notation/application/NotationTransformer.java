package uk.gegc.qbank.features.notation.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.notation.domain.model.MathSpan;
import uk.gegc.qbank.features.notation.domain.model.NotationProblem;
import uk.gegc.qbank.features.notation.domain.model.ScanResult;
import uk.gegc.qbank.features.notation.domain.model.TargetDialect;
import uk.gegc.qbank.shared.exception.NotationException;

import java.util.List;

/**
 * Rewrites portable math delimiters into a target dialect. Text outside math spans, including
 * escaped dollars and any delimiters already in the target dialect, is copied unchanged.
 */
@Component
@RequiredArgsConstructor
public class NotationTransformer {

    private final MathSpanScanner scanner;

    /**
     * @throws NotationException if the text has an unclosed, nested or empty math span
     */
    public String transform(String text, TargetDialect dialect) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        if (dialect == null) {
            throw new IllegalArgumentException("Target dialect must not be null");
        }

        ScanResult result = scanner.scan(text);
        if (!result.transformable()) {
            List<NotationProblem> blocking = result.problems().stream()
                    .filter(p -> p.kind().blocksTransform())
                    .toList();
            throw new NotationException(blocking);
        }
        if (result.spans().isEmpty()) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.length() + result.spans().size() * 4);
        int cursor = 0;
        for (MathSpan span : result.spans()) {
            out.append(text, cursor, span.start());
            out.append(span.block() ? dialect.blockOpen() : dialect.inlineOpen());
            out.append(text, span.contentStart(), span.contentEnd());
            out.append(span.block() ? dialect.blockClose() : dialect.inlineClose());
            cursor = span.end();
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }
}
