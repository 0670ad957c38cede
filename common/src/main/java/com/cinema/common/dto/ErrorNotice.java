package com.cinema.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ErrorNotice {

    private String message;

    private String code;
}
