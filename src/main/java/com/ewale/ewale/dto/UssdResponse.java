package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UssdResponse {

    public static final String TYPE_RESPONSE = "response";
    public static final String TYPE_RELEASE = "release";
    public static final String TYPE_ADD_TO_CART = "AddToCart";

    public static final String DATA_TYPE_INPUT = "input";
    public static final String DATA_TYPE_DISPLAY = "display";

    public static final String FIELD_TYPE_TEXT = "text";
    public static final String FIELD_TYPE_NUMBER = "number";
    public static final String FIELD_TYPE_PHONE = "phone";
    public static final String FIELD_TYPE_DECIMAL = "decimal";

    @JsonProperty("SessionId")
    private String sessionId;

    @JsonProperty("Type")
    private String type;

    @JsonProperty("Label")
    private String label;

    @JsonProperty("Message")
    private String message;

    @JsonProperty("DataType")
    private String dataType;

    @JsonProperty("FieldType")
    private String fieldType;

    @JsonProperty("Item")
    private CheckoutItem item;

    @JsonIgnore
    public boolean isRelease() {
        return TYPE_RELEASE.equals(type);
    }

    @JsonIgnore
    public boolean isAddToCart() {
        return TYPE_ADD_TO_CART.equals(type);
    }
}
