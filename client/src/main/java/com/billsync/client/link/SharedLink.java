package com.billsync.client.link;

/** A distributable URL plus the owner state to persist alongside it. */
public record SharedLink(String url, BillShareState state) {}
