package com.example.iptvcatalog.api.request;

import java.util.List;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class PlaylistPreviewRequest {

    @NotEmpty
    private List<@NotBlank String> urls;
}
