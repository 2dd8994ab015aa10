package com.twinforge.core.generation;

import com.twinforge.core.collaborator.GenerationCollaborator;
import com.twinforge.core.collaborator.GenerationRequest;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;

/**
 * Offline generation provider. Produces a small FastAPI backend or React frontend that
 * mentions every endpoint of the contract slice, so static verification passes.
 */
public class MockGenerationCollaborator implements GenerationCollaborator {

    private static final Logger log = LoggerFactory.getLogger(MockGenerationCollaborator.class);

    @Override
    public ArtifactSet generate(GenerationRequest request) {
        var files = new LinkedHashMap<String, String>();
        switch (request.target()) {
            case BACKEND -> {
                files.put("main.py", backendMain(request.slice()));
                files.put("requirements.txt", "fastapi\nuvicorn\n");
            }
            case FRONTEND -> {
                files.put("src/App.jsx", frontendApp(request.slice()));
                files.put("package.json", """
                        {
                          "name": "generated-frontend",
                          "private": true,
                          "dependencies": {
                            "react": "^18.2.0",
                            "react-dom": "^18.2.0"
                          }
                        }
                        """);
            }
        }
        log.debug("Mock generated {} for {} (sub-iteration {})",
                files.keySet(), request.target().wireName(), request.subIteration());
        return request.priorArtifacts().overlay(new ArtifactSet(files));
    }

    @Override
    public String providerName() {
        return "mock";
    }

    private static String backendMain(ContractSlice slice) {
        var sb = new StringBuilder()
                .append("from fastapi import FastAPI\n")
                .append("from fastapi.middleware.cors import CORSMiddleware\n\n")
                .append("app = FastAPI()\n")
                .append("app.add_middleware(CORSMiddleware, allow_origins=[\"*\"], allow_methods=[\"*\"], allow_headers=[\"*\"])\n");
        if (slice == null || slice.endpoints().isEmpty()) {
            sb.append("\n\n@app.get(\"/\")\ndef read_root():\n    return {\"Hello\": \"World\"}\n");
            return sb.toString();
        }
        int index = 0;
        for (Endpoint endpoint : slice.endpoints()) {
            index++;
            sb.append("\n\n@app.").append(endpoint.method().toLowerCase(Locale.ROOT))
                    .append("(\"").append(endpoint.path()).append("\")\n")
                    .append("def handler_").append(index).append("():\n")
                    .append("    return {\"endpoint\": \"").append(endpoint.signature()).append("\"}\n");
        }
        return sb.toString();
    }

    private static String frontendApp(ContractSlice slice) {
        String baseUrl = slice == null ? "http://localhost:8080" : slice.baseUrl();
        var sb = new StringBuilder()
                .append("import React, { useEffect, useState } from 'react';\n\n")
                .append("const API_BASE = '").append(baseUrl).append("';\n\n")
                .append("function App() {\n")
                .append("  const [data, setData] = useState({});\n\n")
                .append("  useEffect(() => {\n");
        if (slice != null) {
            for (Endpoint endpoint : slice.endpoints()) {
                sb.append("    fetch(`${API_BASE}").append(endpoint.path())
                        .append("`, { method: '").append(endpoint.method()).append("' })\n")
                        .append("      .then((r) => r.json())\n")
                        .append("      .then((body) => setData((d) => ({ ...d, '")
                        .append(endpoint.signature()).append("': body })));\n");
            }
        }
        sb.append("  }, []);\n\n")
                .append("  return <pre>{JSON.stringify(data, null, 2)}</pre>;\n")
                .append("}\n\n")
                .append("export default App;\n");
        return sb.toString();
    }
}
