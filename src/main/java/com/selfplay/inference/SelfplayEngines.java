package com.selfplay.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

import com.selfplay.runtime.SetupResult;

public final class SelfplayEngines {
    private SelfplayEngines() {
    }

    public static SetupResult<SelfplayEngine> fromClasspath(String requestedName) {
        List<SelfplayEngine> available = new ArrayList<>();
        ServiceLoader.load(SelfplayEngine.class).forEach(available::add);
        return select(available, requestedName);
    }

    static SetupResult<SelfplayEngine> select(List<SelfplayEngine> available, String requestedName) {
        if (available.isEmpty()) {
            return SetupResult.failed("No SelfplayEngine implementation found on the class path");
        }
        if (requestedName == null || requestedName.isBlank()) {
            if (available.size() == 1) {
                return SetupResult.ok(available.get(0));
            }
            return SetupResult.failed("Several engines available, set engine.name to one of " + names(available));
        }
        for (SelfplayEngine engine : available) {
            if (requestedName.equals(engine.name())) {
                return SetupResult.ok(engine);
            }
        }
        return SetupResult.failed("Unknown engine '" + requestedName + "', available: " + names(available));
    }

    private static String names(List<SelfplayEngine> engines) {
        return engines.stream().map(SelfplayEngine::name).collect(Collectors.joining(", ", "[", "]"));
    }
}
