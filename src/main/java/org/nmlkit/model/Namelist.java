package org.nmlkit.model;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.diagnostics.DiagnosticsEngine;
import org.nmlkit.merge.MergeStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A namelist document: an ordered collection of {@link NamelistGroup}s.
 * <p>
 * Group names are case-insensitive. Groups keep their first-insertion order, which is the
 * order they are written in unless sorting is requested.
 */
public class Namelist {

    private static final Logger log = LoggerFactory.getLogger(Namelist.class);

    private final Map<String, NamelistGroup> groups = new LinkedHashMap<>();

    /**
     * Returns the group with the given name, creating an empty one if needed.
     * @param name The group name.
     * @return The existing or new group.
     */
    public NamelistGroup insertGroup(String name) {
        return groups.computeIfAbsent(NamelistGroup.normalize(name), NamelistGroup::new);
    }

    /**
     * Adds a new empty group.
     * @param name The group name.
     * @return The new group.
     * @throws NamelistException with {@link NamelistErrorCode#DUPLICATE_NAME} if the group exists.
     */
    public NamelistGroup addGroup(String name) throws NamelistException {
        String key = NamelistGroup.normalize(name);
        if (groups.containsKey(key)) {
            throw new NamelistException(NamelistErrorCode.DUPLICATE_NAME, "Group already exists", key, null);
        }
        return insertGroup(key);
    }

    /**
     * Stores a group under its own name, replacing a group of that name in place.
     * @param group The group.
     * @return The replaced group, or empty.
     */
    public Optional<NamelistGroup> insertGroupObject(NamelistGroup group) {
        return Optional.ofNullable(groups.put(group.getName(), group));
    }

    public Optional<NamelistGroup> getGroup(String name) {
        return Optional.ofNullable(groups.get(NamelistGroup.normalize(name)));
    }

    /**
     * Returns a group that must exist.
     * @param name The group name.
     * @return The group.
     * @throws NamelistException with {@link NamelistErrorCode#GROUP_NOT_FOUND} if it is missing.
     */
    public NamelistGroup requireGroup(String name) throws NamelistException {
        NamelistGroup group = groups.get(NamelistGroup.normalize(name));
        if (group == null) {
            throw new NamelistException(NamelistErrorCode.GROUP_NOT_FOUND, "Group not found",
                    NamelistGroup.normalize(name), null);
        }
        return group;
    }

    public boolean hasGroup(String name) {
        return groups.containsKey(NamelistGroup.normalize(name));
    }

    public Optional<NamelistGroup> removeGroup(String name) {
        return Optional.ofNullable(groups.remove(NamelistGroup.normalize(name)));
    }

    /**
     * Returns the group names in document order.
     * @return An unmodifiable list of names.
     */
    public List<String> groupNames() {
        return Collections.unmodifiableList(new ArrayList<>(groups.keySet()));
    }

    public Collection<NamelistGroup> groups() {
        return Collections.unmodifiableCollection(groups.values());
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /**
     * Applies another document as a patch: groups present here are patched variable by
     * variable, new groups are appended.
     * <p>
     * Not transactional: groups are updated one at a time.
     *
     * @param patch The patch document.
     */
    public void applyPatch(Namelist patch) {
        for (NamelistGroup patchGroup : patch.groups.values()) {
            NamelistGroup existing = groups.get(patchGroup.getName());
            if (existing != null) {
                existing.applyPatch(patchGroup);
            } else {
                groups.put(patchGroup.getName(), patchGroup.copy());
            }
        }
    }

    /**
     * Applies only some groups of a patch.
     * @param patch The patch document.
     * @param include Groups to apply; {@code null} or empty applies all.
     * @param exclude Groups to leave out; may be {@code null}.
     */
    public void applySelectivePatch(Namelist patch, Set<String> include, Set<String> exclude) {
        Namelist selected = new Namelist();
        for (NamelistGroup patchGroup : patch.groups.values()) {
            String name = patchGroup.getName();
            boolean included = include == null || include.isEmpty() || containsIgnoreCase(include, name);
            boolean excluded = exclude != null && containsIgnoreCase(exclude, name);
            if (included && !excluded) {
                selected.insertGroupObject(patchGroup);
            } else {
                log.debug("Skipping patch group '{}'", name);
            }
        }
        applyPatch(selected);
    }

    /**
     * Merges another document into this one.
     * @param other The document to merge in.
     * @param strategy How existing variables are combined; with {@link MergeStrategy#SKIP_EXISTING}
     *                 groups that already exist are merged but keep their variables.
     */
    public void mergeWithStrategy(Namelist other, MergeStrategy strategy) {
        for (NamelistGroup otherGroup : other.groups.values()) {
            NamelistGroup existing = groups.get(otherGroup.getName());
            if (existing != null) {
                existing.mergeWithStrategy(otherGroup, strategy);
            } else {
                groups.put(otherGroup.getName(), otherGroup.copy());
            }
        }
    }

    /**
     * Builds the patch that turns this document into {@code other}.
     * @param other The target document.
     * @return A document containing only new or changed variables.
     */
    public Namelist createPatchFrom(Namelist other) {
        Namelist patch = new Namelist();
        for (NamelistGroup otherGroup : other.groups.values()) {
            NamelistGroup existing = groups.get(otherGroup.getName());
            NamelistGroup diff = existing != null ? existing.createPatchFrom(otherGroup) : otherGroup.copy();
            if (!diff.isEmpty()) {
                patch.insertGroupObject(diff);
            }
        }
        return patch;
    }

    /**
     * Checks array element types and multi-array dimensions.
     * @return The collected findings.
     */
    public DiagnosticsEngine validate() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        NamelistValidator.validate(this, diagnostics);
        return diagnostics;
    }

    /**
     * Validates the document and fails on the first error.
     * @throws NamelistException with {@link NamelistErrorCode#VALIDATION_FAILED} listing all errors.
     */
    public void validateOrThrow() throws NamelistException {
        DiagnosticsEngine diagnostics = validate();
        if (diagnostics.hasErrors()) {
            throw new NamelistException(NamelistErrorCode.VALIDATION_FAILED,
                    "Namelist validation failed:\n" + diagnostics.summary());
        }
    }

    /**
     * Returns a deep copy of the document structure.
     * @return The copy.
     */
    public Namelist copy() {
        Namelist copy = new Namelist();
        for (NamelistGroup group : groups.values()) {
            copy.groups.put(group.getName(), group.copy());
        }
        return copy;
    }

    /**
     * Formats the document as canonical namelist text.
     * @param options The write options.
     * @return The text.
     */
    public String toFortranString(WriteOptions options) {
        return NamelistWriter.write(this, options);
    }

    private static boolean containsIgnoreCase(Set<String> names, String name) {
        return names.stream().anyMatch(n -> NamelistGroup.normalize(n).equals(name));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Namelist other)) return false;
        return new ArrayList<>(groups.keySet()).equals(new ArrayList<>(other.groups.keySet()))
                && groups.equals(other.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groups);
    }

    @Override
    public String toString() {
        return toFortranString(WriteOptions.defaults());
    }
}
