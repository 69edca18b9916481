package uk.gegc.qbank.features.merge.domain.model;

import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

public record MergeResult(QuestionCollection collection, MergeReport report) {
}
