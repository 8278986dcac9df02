package com.billsync.client.link;

import com.billsync.protocol.JsonWebKey;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything the owner's device keeps about one shared bill. Persist it after every call that
 * returns a new one; the private signing key never leaves the device.
 */
public record BillShareState(
        String shareId,
        JsonWebKey contentKey,      // oct, A256GCM
        JsonWebKey signingKey,      // EC P-384 with d
        String updateToken,
        long version,
        Map<String, ParticipantLink> participantLinks
) {

    public BillShareState {
        participantLinks = participantLinks == null ? Map.of() : Map.copyOf(participantLinks);
    }

    public BillShareState withVersion(long newVersion) {
        return new BillShareState(shareId, contentKey, signingKey, updateToken, newVersion, participantLinks);
    }

    public BillShareState withParticipantLink(String participantId, ParticipantLink link) {
        Map<String, ParticipantLink> links = new HashMap<>(participantLinks);
        links.put(participantId, link);
        return new BillShareState(shareId, contentKey, signingKey, updateToken, version, links);
    }
}
