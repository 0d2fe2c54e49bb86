package biz.kryukov.dev.svcwatch.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fixed list of operator-declared targets, for example from application properties.
 */
public final class StaticTargetRegistry implements TargetRegistry {

    private final String name;
    private final CopyOnWriteArrayList<TargetDefinition> definitions;

    public StaticTargetRegistry(String name, List<TargetDefinition> definitions) {
        this.name = name;
        this.definitions = new CopyOnWriteArrayList<>(definitions);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean available() {
        return true;
    }

    @Override
    public List<TargetDefinition> targets() {
        return new ArrayList<>(definitions);
    }
}
