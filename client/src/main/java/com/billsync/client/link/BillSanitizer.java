package com.billsync.client.link;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Strips what must not travel with a shared bill: participants' contact details, including those
 * nested in the original bills of a summary bill, and the owner's own share bookkeeping.
 */
final class BillSanitizer {

    static final List<String> CONTACT_FIELDS = List.of("phone", "email");
    static final List<String> OWNER_FIELDS = List.of("shareInfo", "participantShareInfo");

    private BillSanitizer() {
    }

    /** Returns a sanitized deep copy; {@code bill} is not modified. */
    static ObjectNode sanitize(ObjectNode bill) {
        ObjectNode copy = bill.deepCopy();
        copy.remove(OWNER_FIELDS);
        stripContacts(copy.path("participants"));
        for (JsonNode item : copy.path("items")) {
            stripContacts(item.path("originalBillData").path("participants"));
        }
        return copy;
    }

    private static void stripContacts(JsonNode participants) {
        for (JsonNode participant : participants) {
            if (participant instanceof ObjectNode object) {
                object.remove(CONTACT_FIELDS);
            }
        }
    }
}
