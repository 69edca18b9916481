package uk.gegc.qbank.features.merge.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.merge.domain.model.ConflictAssessment;
import uk.gegc.qbank.features.merge.domain.model.ConflictRecord;
import uk.gegc.qbank.features.merge.domain.model.ResolvedIdSpace;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns collision-free ids across several collections.
 * <p>
 * Collections are walked in the given order and each in its own order. The first occurrence of an id keeps it;
 * every later occurrence becomes {@code <id>_<n>} with the smallest positive {@code n} not used by any id
 * accepted so far, original or generated. Each rename is scored against the question that kept the id.
 */
@Slf4j
@Component
public class ConflictResolver {

    public ResolvedIdSpace resolve(List<QuestionCollection> collections) {
        if (collections == null) {
            throw new IllegalArgumentException("Collections must not be null");
        }

        // accepted id -> question that holds it
        Map<String, Question> holders = new HashMap<>();
        // next suffix worth trying per base id; every smaller suffix is already taken
        Map<String, Integer> nextSuffix = new HashMap<>();
        List<List<String>> finalIds = new ArrayList<>(collections.size());
        List<ConflictRecord> conflicts = new ArrayList<>();

        for (int source = 0; source < collections.size(); source++) {
            List<Question> questions = collections.get(source).questions();
            List<String> ids = new ArrayList<>(questions.size());
            for (int position = 0; position < questions.size(); position++) {
                Question question = questions.get(position);
                String original = question.id();
                if (original == null) {
                    throw new IllegalArgumentException(
                            "Question at source " + source + " position " + position + " has no id");
                }

                String accepted = original;
                if (holders.containsKey(original)) {
                    int n = nextSuffix.getOrDefault(original, 1);
                    while (holders.containsKey(original + "_" + n)) {
                        n++;
                    }
                    accepted = original + "_" + n;
                    nextSuffix.put(original, n + 1);
                    double similarity = ContentDuplicateDetector.calculateSimilarity(
                            ContentDuplicateDetector.words(holders.get(original).text()),
                            ContentDuplicateDetector.words(question.text()));
                    ConflictAssessment assessment = ConflictAssessment.of(similarity);
                    conflicts.add(new ConflictRecord(source, position, original, accepted, similarity, assessment));
                    log.debug("Id collision: source={}, position={}, id={} -> {}, assessment={}",
                            source, position, original, accepted, assessment);
                }
                holders.put(accepted, question);
                ids.add(accepted);
            }
            finalIds.add(ids);
        }

        return new ResolvedIdSpace(finalIds, conflicts);
    }
}
