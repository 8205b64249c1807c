package com.skillswap.billing.mapper;

import com.skillswap.billing.api.response.ReconciliationIssueResponse;
import com.skillswap.billing.model.ReconciliationIssue;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface ReconciliationIssueMapper {

    ReconciliationIssueMapper INSTANCE = Mappers.getMapper(ReconciliationIssueMapper.class);

    ReconciliationIssueResponse toResponse(ReconciliationIssue issue);

    List<ReconciliationIssueResponse> toResponseList(List<ReconciliationIssue> issues);
}
