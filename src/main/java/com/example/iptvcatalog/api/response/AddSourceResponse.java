package com.example.iptvcatalog.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddSourceResponse {

    private M3uSourceResponse source;
    private Long jobId;
}
