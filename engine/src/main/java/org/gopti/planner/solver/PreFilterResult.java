package org.gopti.planner.solver;

import lombok.Value;
import org.gopti.planner.model.DropRecord;
import org.gopti.planner.model.Event;

import java.util.List;

@Value
public class PreFilterResult {
    List<Event> kept;
    List<DropRecord> dropped;
}
