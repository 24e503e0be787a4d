package com.oregontrail.mode;

import lombok.Value;

import java.util.OptionalInt;

/**
 * Parsed line of player input: the trimmed text and, when it is a whole number, its value.
 */
@Value
public class DialogResponse {

    String text;

    OptionalInt number;

    /**
     * Parse raw input.
     *
     * @param input the input line, may be null
     * @return the parsed response
     */
    public static DialogResponse parse(String input) {
        String text = input == null ? "" : input.trim();
        try {
            return new DialogResponse(text, OptionalInt.of(Integer.parseInt(text)));
        } catch (NumberFormatException e) {
            return new DialogResponse(text, OptionalInt.empty());
        }
    }

    /**
     * The number if the input was a whole number greater than zero.
     *
     * @return the positive choice or empty
     */
    public OptionalInt getPositiveNumber() {
        if (number.isPresent() && number.getAsInt() > 0) {
            return number;
        }
        return OptionalInt.empty();
    }
}
