/*-
 * #%L
 * ECAT to NIfTI conversion for Fiji.
 * %%
 * Copyright (C) 2008 - 2023 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.ecat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-frame timing and count values collected while scaling frames, one entry per frame, in frame order.
 * These are the columns of a .sif timing file: start and duration in seconds, prompts and randoms in counts.
 */
public class FrameTimings {
    private final List<Double> starts = new ArrayList<>();
    private final List<Double> durations = new ArrayList<>();
    private final List<Double> prompts = new ArrayList<>();
    private final List<Double> randoms = new ArrayList<>();

    void add(double start, double duration, double prompt, double random) {
        starts.add(start);
        durations.add(duration);
        prompts.add(prompt);
        randoms.add(random);
    }

    public int size() {
        return starts.size();
    }

    public List<Double> getStarts() {
        return Collections.unmodifiableList(starts);
    }

    public List<Double> getDurations() {
        return Collections.unmodifiableList(durations);
    }

    public List<Double> getPrompts() {
        return Collections.unmodifiableList(prompts);
    }

    public List<Double> getRandoms() {
        return Collections.unmodifiableList(randoms);
    }

    public String toString() {
        return "FrameTimings(starts=" + starts
                + ", durations=" + durations
                + ", prompts=" + prompts
                + ", randoms=" + randoms
                + ")";
    }
}
