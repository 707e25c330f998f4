package com.storyweave.flowsync.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canvas position. Layout only; carries no meaning for the script.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Position {
    private double x;
    private double y;

    public static Position origin() {
        return new Position(0, 0);
    }
}
