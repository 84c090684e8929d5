package com.knowledgeagent.backend.evidence;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PackageManifestSummary(
    String name,
    String version,
    Map<String, String> engines,
    Map<String, String> scripts,
    Map<String, String> dependencies,
    Map<String, String> devDependencies,
    Map<String, String> peerDependencies,
    Map<String, String> optionalDependencies,
    Object workspaces,
    String packageManager) {}
