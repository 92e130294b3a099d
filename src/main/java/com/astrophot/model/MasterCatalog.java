package com.astrophot.model;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

public class MasterCatalog {

    private final List<Frame> frames;
    private final List<MasterStar> stars;
    private final int targetId;
    private final Set<String> skippedFrameIds;

    public MasterCatalog(List<Frame> frames, List<MasterStar> stars, int targetId, Set<String> skippedFrameIds) {
        this.frames = List.copyOf(frames);
        this.stars = List.copyOf(stars);
        this.targetId = targetId;
        this.skippedFrameIds = Set.copyOf(skippedFrameIds);
        for (MasterStar s : this.stars) s.freeze();
    }

    /** Frames en orden temporal, incluidos los vacíos. */
    public List<Frame> frames() { return frames; }

    public List<Frame> usableFrames() {
        List<Frame> out = new ArrayList<>();
        for (Frame f : frames) if (!skippedFrameIds.contains(f.id)) out.add(f);
        return out;
    }

    public int usableFrameCount() { return frames.size() - skippedFrameIds.size(); }

    public Set<String> skippedFrameIds() { return skippedFrameIds; }

    public List<MasterStar> stars() { return stars; }

    public int targetId() { return targetId; }

    public MasterStar target() { return star(targetId); }

    public MasterStar star(int id) {
        for (MasterStar s : stars) if (s.id() == id) return s;
        throw new NoSuchElementException("No existe la estrella " + id);
    }

    public List<MasterStar> comparisonCandidates() {
        List<MasterStar> out = new ArrayList<>(stars.size());
        for (MasterStar s : stars) if (s.id() != targetId) out.add(s);
        return out;
    }
}
