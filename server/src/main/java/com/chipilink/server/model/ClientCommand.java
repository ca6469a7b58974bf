package com.chipilink.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Text frame sent by a browser client: {@code {"action":"join","room":"store"}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientCommand {

    @NotNull
    @Pattern(regexp = "^(join|leave|ping)$")
    public String action;

    @Size(min = 1, max = 40)
    @Pattern(regexp = "^[a-z0-9_\\-]+$")
    public String room;

    @Size(max = 64)
    public String nonce;
}
