package com.repotide.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class HealthResponse {
    private String status;
    private String database;
}
