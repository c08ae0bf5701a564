package com.example.intel.model.market;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceBar {
    private Instant time;
    private Double close;
    private Long volume;
}
