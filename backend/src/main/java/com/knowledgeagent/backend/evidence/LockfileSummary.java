package com.knowledgeagent.backend.evidence;

public record LockfileSummary(int lines, long byteSize) {}
