package com.jliquid.context;

import com.jliquid.error.ScopeUnderflowException;
import com.jliquid.error.UnsupportedVariableKindException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Stack of scope frames. Frame 0 is the base scope and is never removed;
 * lookups go from the innermost frame outwards, so inner bindings shadow outer ones.
 */
public class Context {
    private static final Logger LOGGER = LoggerFactory.getLogger(Context.class);

    private final MutableList<MutableMap<String, Variable>> frames = Lists.mutable.empty();

    public Context() {
        frames.add(Maps.mutable.empty());
    }

    public void push() {
        frames.add(Maps.mutable.empty());
        LOGGER.debug("Pushed scope, depth {}", frames.size());
    }

    /**
     * @throws ScopeUnderflowException if only the base scope is left
     */
    public void pop() {
        if (frames.size() == 1) {
            throw new ScopeUnderflowException();
        }
        frames.remove(frames.size() - 1);
        LOGGER.debug("Popped scope, depth {}", frames.size());
    }

    public int depth() {
        return frames.size();
    }

    public void add(String key, Variable value) {
        if (value == null) {
            throw new UnsupportedVariableKindException(key, "null");
        }
        frames.getLast().put(key, value);
    }

    public void add(String key, String value) {
        if (value == null) {
            throw new UnsupportedVariableKindException(key, "null");
        }
        add(key, Variable.text(value));
    }

    public void add(String key, double value) {
        add(key, Variable.number(value));
    }

    public void add(String key, boolean value) {
        add(key, Variable.bool(value));
    }

    public Optional<Variable> lookup(String key) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            Variable value = frames.get(i).get(key);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
