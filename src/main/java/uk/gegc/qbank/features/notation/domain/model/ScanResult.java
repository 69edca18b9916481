package uk.gegc.qbank.features.notation.domain.model;

import java.util.List;

public record ScanResult(List<MathSpan> spans, List<NotationProblem> problems) {

    public ScanResult {
        spans = spans == null ? List.of() : List.copyOf(spans);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public boolean transformable() {
        return problems.stream().noneMatch(p -> p.kind().blocksTransform());
    }
}
