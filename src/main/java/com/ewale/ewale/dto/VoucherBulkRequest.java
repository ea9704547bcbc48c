package com.ewale.ewale.dto;

import com.ewale.ewale.entity.VoucherType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
public class VoucherBulkRequest {
    @NotNull(message = "Voucher type is required")
    private VoucherType voucherType;

    @NotEmpty(message = "At least one voucher is required")
    @Valid
    private List<Entry> vouchers;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        @NotBlank(message = "Serial number is required")
        private String serialNumber;

        @NotBlank(message = "PIN is required")
        private String pin;
    }
}
