package uk.gegc.qbank.shared.exception;

import uk.gegc.qbank.features.notation.domain.model.NotationProblem;

import java.util.List;
import java.util.stream.Collectors;

public class NotationException extends RuntimeException {

    private final List<NotationProblem> problems;

    public NotationException(List<NotationProblem> problems) {
        super("Text is not valid portable math: " + problems.stream()
                .map(NotationProblem::describe)
                .collect(Collectors.joining("; ")));
        this.problems = List.copyOf(problems);
    }

    public List<NotationProblem> getProblems() {
        return problems;
    }
}
