package com.ewale.ewale.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoucherBulkResponse {
    private int imported;
    private int skipped;
    private List<String> duplicateSerials = new ArrayList<>();
}
