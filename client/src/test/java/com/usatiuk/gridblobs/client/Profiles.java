package com.usatiuk.gridblobs.client;

import io.quarkus.test.junit.QuarkusTestProfile;

import java.util.HashMap;
import java.util.Map;

public class Profiles {
    public static class DefaultChunkingProfile implements QuarkusTestProfile {
    }

    public static class SmallChunkingProfile implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            var ret = new HashMap<String, String>();
            ret.put("gridblobs.chunk-size", "3");
            return ret;
        }
    }
}
