package com.example.intel.analysis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisItem {
    private String symbol;
    private String thesis;
    private String analysis;
    private String sentiment;
}
