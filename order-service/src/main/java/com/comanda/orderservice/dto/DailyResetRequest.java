package com.comanda.orderservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DailyResetRequest {
    @NotEmpty(message = "Reset must contain at least one item")
    @Valid
    private List<DailyResetItem> items;
}
