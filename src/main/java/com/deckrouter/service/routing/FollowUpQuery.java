package com.deckrouter.service.routing;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A parsed follow-up query: the tool the user already picked, the question they originally
 * asked and, for a plant correction, the entity code they chose.
 */
@Data
@AllArgsConstructor
public class FollowUpQuery {

    private String toolName;
    private String originalQuery;
    private Integer forcedCode;

    public boolean hasForcedCode() {
        return forcedCode != null;
    }
}
