package org.jouca.live_arrivals.services;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jouca.live_arrivals.records.Address;

/**
 * Parses the labelled address the schedule stores in a stop's description, e.g.
 * {@code רחוב:הרצל 1 עיר:חולון רציף: קומה:}.
 *
 * <p>Layouts are tried in order; the first one matching the start of the text wins. Each
 * value is trimmed. Text matching no layout gives {@link Address#EMPTY}.
 *
 * @author Jouca
 * @since 1.0
 */
public class AddressParser {

    /** Hebrew labels first, then the English labels used by some feeds. */
    static final List<Pattern> LAYOUTS = List.of(
        Pattern.compile("(?:רחוב:)(?<street>.*)(?:עיר:)(?<city>.*)(?:רציף:)(?<platform>.*)(?:קומה:)(?<floor>.*)"),
        Pattern.compile("(?:Street:)(?<street>.*)(?:City:)(?<city>.*)(?:Platform:)(?<platform>.*)(?:Floor:)(?<floor>.*)")
    );

    /**
     * @param description raw stop description, may be null
     * @return the parsed address, never null
     */
    public Address parse(String description) {
        if (description == null || description.isBlank()) {
            return Address.EMPTY;
        }
        String text = description.strip();
        for (Pattern layout : LAYOUTS) {
            Matcher matcher = layout.matcher(text);
            if (matcher.lookingAt()) {
                return new Address(
                    matcher.group("street").strip(),
                    matcher.group("city").strip(),
                    matcher.group("platform").strip(),
                    matcher.group("floor").strip());
            }
        }
        return Address.EMPTY;
    }
}
