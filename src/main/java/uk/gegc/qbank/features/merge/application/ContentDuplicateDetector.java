package uk.gegc.qbank.features.merge.application;

import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.merge.domain.model.ConflictRecord;
import uk.gegc.qbank.features.merge.domain.model.DuplicateCandidate;
import uk.gegc.qbank.features.merge.domain.model.ResolvedIdSpace;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Finds pairs of questions from different sources with near-identical stems.
 * A pair already reported as an id conflict is not reported again.
 */
@Component
public class ContentDuplicateDetector {

    public List<DuplicateCandidate> detect(List<QuestionCollection> collections, ResolvedIdSpace idSpace, double threshold) {
        List<Entry> entries = new ArrayList<>();
        for (int source = 0; source < collections.size(); source++) {
            List<Question> questions = collections.get(source).questions();
            for (int position = 0; position < questions.size(); position++) {
                Question question = questions.get(position);
                entries.add(new Entry(source, idSpace.finalId(source, position), question, words(question.text())));
            }
        }

        Set<List<String>> conflictPairs = new HashSet<>();
        for (ConflictRecord conflict : idSpace.conflicts()) {
            // the question that kept the id still carries it as its final id
            conflictPairs.add(pairKey(conflict.originalId(), conflict.finalId()));
            conflictPairs.add(pairKey(conflict.finalId(), conflict.originalId()));
        }

        List<DuplicateCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Entry first = entries.get(i);
            for (int j = i + 1; j < entries.size(); j++) {
                Entry second = entries.get(j);
                if (first.source() == second.source() || conflictPairs.contains(pairKey(first.id(), second.id()))) {
                    continue;
                }
                double similarity = calculateSimilarity(first.words(), second.words());
                if (similarity >= threshold) {
                    candidates.add(new DuplicateCandidate(first.source(), first.id(),
                            second.source(), second.id(), similarity,
                            metadataDifferences(first.question(), second.question())));
                }
            }
        }
        return candidates;
    }

    /**
     * Names of the fields both questions set to different values.
     */
    static List<String> metadataDifferences(Question first, Question second) {
        List<String> differences = new ArrayList<>();
        addIfDifferent(differences, "type", first.type(), second.type());
        addIfDifferent(differences, "points", first.points(), second.points());
        addIfDifferent(differences, Question.TOPIC, first.topic(), second.topic());
        addIfDifferent(differences, Question.SUBTOPIC, first.subtopic(), second.subtopic());
        addIfDifferent(differences, Question.DIFFICULTY, first.difficulty(), second.difficulty());
        return differences;
    }

    private static void addIfDifferent(List<String> differences, String field, Object first, Object second) {
        if (first != null && second != null && !Objects.equals(first, second)) {
            differences.add(field);
        }
    }

    private static List<String> pairKey(String firstId, String secondId) {
        return List.of(firstId, secondId);
    }

    /**
     * Word-level Jaccard similarity of two token sets.
     */
    static double calculateSimilarity(Set<String> set1, Set<String> set2) {
        Set<String> intersection = new HashSet<>(set1);
        intersection.retainAll(set2);

        Set<String> union = new HashSet<>(set1);
        union.addAll(set2);

        return union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
    }

    static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(text.trim().toLowerCase(Locale.ROOT).split("\\s+")));
    }

    private record Entry(int source, String id, Question question, Set<String> words) {
    }
}
