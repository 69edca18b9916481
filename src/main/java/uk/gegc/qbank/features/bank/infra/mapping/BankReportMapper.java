package uk.gegc.qbank.features.bank.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.qbank.features.bank.api.dto.ConflictRecordDto;
import uk.gegc.qbank.features.bank.api.dto.DuplicateCandidateDto;
import uk.gegc.qbank.features.bank.api.dto.MergeReportDto;
import uk.gegc.qbank.features.bank.api.dto.SourceViolationDto;
import uk.gegc.qbank.features.merge.domain.model.ConflictRecord;
import uk.gegc.qbank.features.merge.domain.model.DuplicateCandidate;
import uk.gegc.qbank.features.merge.domain.model.MergeReport;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface BankReportMapper {
    MergeReportDto toDto(MergeReport report);

    ConflictRecordDto toDto(ConflictRecord conflict);

    DuplicateCandidateDto toDto(DuplicateCandidate candidate);

    SourceViolationDto toDto(SourceViolation violation);

    List<SourceViolationDto> toViolationDtos(List<SourceViolation> violations);
}
