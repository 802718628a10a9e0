package com.tomlformatter.toml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A table written as {@code {k = v, ...}}. Always rendered on one line.
 */
public final class InlineTableValue extends TomlValue {
    private final List<Member> members;

    public InlineTableValue(List<Member> members) {
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

    public List<Member> getMembers() {
        return members;
    }

    @Override
    public String renderInline() {
        return members.stream()
                .map(member -> member.getKey().render() + " = " + member.getValue().renderInline())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public boolean containsLineBreak() {
        return members.stream().anyMatch(member -> member.getValue().containsLineBreak());
    }

    @Override
    public boolean containsComments() {
        return members.stream().anyMatch(member -> member.getValue().containsComments());
    }

    public static final class Member {
        private final TomlKey key;
        private final TomlValue value;

        public Member(TomlKey key, TomlValue value) {
            this.key = key;
            this.value = value;
        }

        public TomlKey getKey() {
            return key;
        }

        public TomlValue getValue() {
            return value;
        }
    }
}
