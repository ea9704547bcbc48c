package com.ewale.ewale.service.ussd;

import com.ewale.ewale.dto.ServiceQueryItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BundleGroup {
    private String name;
    private List<ServiceQueryItem> bundles = new ArrayList<>();
}
