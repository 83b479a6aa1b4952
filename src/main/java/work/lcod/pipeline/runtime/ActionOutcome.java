package work.lcod.pipeline.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

public record ActionOutcome(String key, String name, OutcomeState state, String link) {
    public ActionOutcome {
        link = link == null ? "" : link;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("state", state.name());
        map.put("link", link);
        return map;
    }
}
