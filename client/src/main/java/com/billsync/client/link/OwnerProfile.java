package com.billsync.client.link;

import com.fasterxml.jackson.databind.JsonNode;

/** Who is sharing, as shown to recipients. */
public record OwnerProfile(String displayName, JsonNode paymentDetails) {}
