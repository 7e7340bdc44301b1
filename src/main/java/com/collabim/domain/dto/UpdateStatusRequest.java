package com.collabim.domain.dto;

import lombok.Data;

/**
 * 两个字段至少填一个；取值非法时返回 bad_status / bad_recruitment_status。
 */
@Data
public class UpdateStatusRequest {

    private String status;

    private String recruitmentStatus;
}
