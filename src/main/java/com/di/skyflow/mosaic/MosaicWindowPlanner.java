package com.di.skyflow.mosaic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sliding-window selection of mosaic members.
 *
 * <pre>
 * first window   oldest msPerMosaic tiles
 * next windows   last `overlap` tiles of the previous window
 *                + oldest (msPerMosaic - overlap) tiles not yet used
 * </pre>
 * Members are always returned in observation order, whatever order the inputs arrive in.
 */
public class MosaicWindowPlanner {

    private final int msPerMosaic;
    private final int overlap;

    public MosaicWindowPlanner(int msPerMosaic, int overlap) {
        if (msPerMosaic < 1) {
            throw new IllegalArgumentException("msPerMosaic must be >= 1, got " + msPerMosaic);
        }
        if (overlap < 0 || overlap >= msPerMosaic) {
            throw new IllegalArgumentException("overlap must be in [0, " + msPerMosaic + "), got " + overlap);
        }
        this.msPerMosaic = msPerMosaic;
        this.overlap = overlap;
    }

    /**
     * @param unconsumed       tiles that have not been in any mosaic yet, any order
     * @param previousMembers  members of the most recent window, any order; empty for the first
     * @return the next window, or empty if not enough new tiles are available
     */
    public Optional<MosaicWindow> nextWindow(List<MosaicTile> unconsumed, List<MosaicTile> previousMembers) {
        List<MosaicTile> reused = new ArrayList<>();
        if (previousMembers != null && !previousMembers.isEmpty()) {
            List<MosaicTile> previous = new ArrayList<>(previousMembers);
            previous.sort(MosaicTile.CHRONOLOGICAL);
            reused.addAll(previous.subList(Math.max(0, previous.size() - overlap), previous.size()));
        }

        Set<String> reusedIds = new HashSet<>();
        for (MosaicTile t : reused) {
            reusedIds.add(t.groupId());
        }
        List<MosaicTile> candidates = new ArrayList<>();
        for (MosaicTile t : unconsumed) {
            if (!reusedIds.contains(t.groupId())) {
                candidates.add(t);
            }
        }
        candidates.sort(MosaicTile.CHRONOLOGICAL);

        int needed = msPerMosaic - reused.size();
        if (candidates.size() < needed) {
            return Optional.empty();
        }
        List<MosaicTile> fresh = new ArrayList<>(candidates.subList(0, needed));
        List<MosaicTile> members = new ArrayList<>(reused);
        members.addAll(fresh);
        members.sort(MosaicTile.CHRONOLOGICAL);
        return Optional.of(new MosaicWindow(members, reused, fresh));
    }

    public int getMsPerMosaic() {
        return msPerMosaic;
    }

    public int getOverlap() {
        return overlap;
    }
}
