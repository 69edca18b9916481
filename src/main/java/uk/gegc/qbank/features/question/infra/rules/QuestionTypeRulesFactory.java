package uk.gegc.qbank.features.question.infra.rules;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.question.domain.model.QuestionType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class QuestionTypeRulesFactory {
    private final Map<QuestionType, QuestionTypeRules> rulesMap = new EnumMap<>(QuestionType.class);

    public QuestionTypeRulesFactory(List<QuestionTypeRules> rules) {
        rules.forEach(rule -> rule.supportedTypes().forEach(type -> rulesMap.put(type, rule)));
        log.info("QuestionTypeRulesFactory initialized with rules for types: {}", rulesMap.keySet());
    }

    public QuestionTypeRules getRules(QuestionType type) {
        QuestionTypeRules rules = rulesMap.get(type);
        if (rules == null) {
            throw new UnsupportedOperationException("No rules for type " + type);
        }
        return rules;
    }
}
