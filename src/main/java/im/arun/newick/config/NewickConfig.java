package im.arun.newick.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NewickConfig {
    @JsonProperty("encoding")
    private String encoding = "UTF-8";

    @JsonProperty("strict_trailing_text")
    private boolean strictTrailingText = false;

    @JsonProperty("strict_ascii")
    private boolean strictAscii = false;

    @JsonProperty("show_internal")
    private boolean showInternal = true;

    @JsonProperty("label_margin")
    private int labelMargin = 4;

    @JsonProperty("preserve_lengths")
    private boolean preserveLengths = true;
}
