package com.luacomposer.core.compose;

/**
 * Concatenates planned sections into the final script text.
 */
public class CompositionEmitter {

    public String emit(CompositionPlan plan) {
        StringBuilder out = new StringBuilder();
        for (Section section : plan.sections()) {
            out.append(section.content());
        }
        return out.toString();
    }
}
