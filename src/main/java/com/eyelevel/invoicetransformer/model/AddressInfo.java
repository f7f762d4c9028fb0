package com.eyelevel.invoicetransformer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A postal address as printed on the source invoice. Blank lines are never stored.
 */
@Value
@Builder(toBuilder = true)
public class AddressInfo {

    public static final int MAX_LINES = 6;

    public static final AddressInfo EMPTY = AddressInfo.builder().build();

    @Singular
    List<String> lines;
    @Builder.Default
    String postCode = "";
    @Builder.Default
    String countryCode = "";
    @Builder.Default
    String country = "";
    @Builder.Default
    String contactName = "";
}
