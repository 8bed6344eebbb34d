package com.shetka.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response envelopes. Every body carries {@code ok}.
 */
public final class ApiResponses {

    private ApiResponses() {}

    public record Ok(@JsonProperty("ok") boolean ok) {
        public static final Ok INSTANCE = new Ok(true);
    }

    public record Orders(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("orders") List<OrderView> orders
    ) {
        public static Orders of(List<OrderView> orders) {
            return new Orders(true, orders);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Error(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error,
        @JsonProperty("fields") List<String> fields
    ) {
        public static Error of(String error) {
            return new Error(false, error, null);
        }

        public static Error of(String error, List<String> fields) {
            return new Error(false, error, fields);
        }
    }
}
