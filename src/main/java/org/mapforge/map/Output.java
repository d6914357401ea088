package org.mapforge.map;

import org.mapforge.math.Vec;

import java.util.regex.Pattern;

/**
 * An entity I/O connection, stored in the {@code connections} block as
 * {@code "OnOutput" "target,Input,params,delay,times"}.
 *
 * @param output The output firing the connection.
 * @param target The target entity name.
 * @param input The input fired on the target.
 * @param params The parameter override, may be empty.
 * @param delay The delay in seconds.
 * @param timesToFire How often the connection may fire; -1 for unlimited.
 */
public record Output(
        String output,
        String target,
        String input,
        String params,
        double delay,
        int timesToFire
) {

    private static final char NEW_SEPARATOR = (char) 0x1B;

    public Output(String output, String target, String input) {
        this(output, target, input, "", 0, -1);
    }

    /**
     * Parses one line of a {@code connections} block. Both the comma and the escape-character
     * separator are accepted.
     *
     * @param output the key, i.e. the output name.
     * @param value the value.
     * @return the connection.
     * @throws IllegalArgumentException if the value has the wrong number of fields.
     */
    public static Output parse(String output, String value) {
        char sep = value.indexOf(NEW_SEPARATOR) >= 0 ? NEW_SEPARATOR : ',';
        String[] parts = value.split(Pattern.quote(String.valueOf(sep)), -1);
        if (parts.length != 5) {
            throw new IllegalArgumentException("Malformed output '" + output + "': " + value);
        }
        try {
            return new Output(output, parts[0], parts[1], parts[2],
                    parts[3].isBlank() ? 0 : Double.parseDouble(parts[3]),
                    parts[4].isBlank() ? -1 : Integer.parseInt(parts[4].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed output '" + output + "': " + value, e);
        }
    }

    public Output withTarget(String newTarget) {
        return new Output(output, newTarget, input, params, delay, timesToFire);
    }

    /**
     * @return the value part in document form.
     */
    public String toValue() {
        return target + ',' + input + ',' + params + ',' + Vec.format(delay) + ',' + timesToFire;
    }
}
