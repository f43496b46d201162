package com.example.iptvcatalog.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateM3uSourceRequest {

    @NotBlank
    @Size(max = 2048)
    @Pattern(regexp = "^(?i)https?://.+", message = "url must be an http(s) address")
    private String url;

    @Size(max = 255)
    private String name;
}
