package com.kendb3.submissions.model;

import com.kendb3.api.fields.ApiEngine;
import com.kendb3.store.LastModified;
import com.kendb3.store.Model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * A Minecraft version.
 */
@Getter
@Setter
public class MinecraftVersion extends Model implements Comparable<MinecraftVersion>, LastModified {

    public static final ApiEngine<MinecraftVersion> API = ApiEngine.of(MinecraftVersion.class, "A Minecraft version.");

    static {
        API.mark().on("comparator");
        API.mark().on("family");
        API.mark().on("displayName");
        API.mark().on("isCommon");
    }

    /**
     * Version number that can be used to compare versions of the same family.
     */
    private int comparator;

    /**
     * Code of the {@link VersionFamily}.
     */
    private short family = (short) VersionFamily.JE.getCode();

    /**
     * User-friendly name like {@code JE 1.19.4}. Plain text.
     */
    private String displayName;

    /**
     * True when this version is well-known and likely to be filtered against.
     */
    private boolean isCommon;

    private Instant lastModified;

    public VersionFamily getVersionFamily() {
        return VersionFamily.fromCode(family);
    }

    public void setVersionFamily(VersionFamily versionFamily) {
        this.family = (short) versionFamily.getCode();
    }

    /**
     * Checks whether it makes sense to compare this version to {@code other}.
     * If so, {@link #compareTo(MinecraftVersion)} and {@link #isSameVersion(MinecraftVersion)}
     * return valid results.
     */
    public boolean canCompareTo(Object other) {
        return other instanceof MinecraftVersion version && version.family == family;
    }

    /**
     * @throws IncomparableVersionsException if the versions belong to different families
     */
    @Override
    public int compareTo(MinecraftVersion other) {
        requireComparable(other);
        return Integer.compare(comparator, other.comparator);
    }

    /**
     * @throws IncomparableVersionsException if the versions belong to different families
     */
    public boolean isSameVersion(MinecraftVersion other) {
        requireComparable(other);
        return comparator == other.comparator;
    }

    private void requireComparable(MinecraftVersion other) {
        if (other.family != family) {
            throw new IncomparableVersionsException(this, other);
        }
    }

    @Override
    public String toString() {
        return "Minecraft version " + displayName;
    }
}
