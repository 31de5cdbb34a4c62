package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * HTTP cache directives. Unset numeric and boolean fields are {@code null} and omitted on output.
 *
 * @param maxAge       {@code max-age} in seconds
 * @param sMaxage      {@code s-maxage} in seconds
 * @param visibility   {@code public} or {@code private}
 * @param noCache      {@code no-cache} flag
 * @param noStore      {@code no-store} flag
 * @param etag         entity tag source
 * @param lastModified dotted path of the last modification date
 * @param vary         request headers the response varies on
 */
@JsonPropertyOrder({"max_age", "s_maxage", "visibility", "no_cache", "no_store", "etag", "last_modified", "vary"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IrCache(
        @JsonProperty("max_age") Integer maxAge,
        @JsonProperty("s_maxage") Integer sMaxage,
        String visibility,
        @JsonProperty("no_cache") Boolean noCache,
        @JsonProperty("no_store") Boolean noStore,
        IrEtag etag,
        @JsonProperty("last_modified") String lastModified,
        List<String> vary) {

    public IrCache {
        vary = Copies.list(vary);
    }
}
