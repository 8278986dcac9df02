package com.billsync.protocol.share;

import java.util.List;

public record BatchStatusRequest(List<String> shareIds) {}
