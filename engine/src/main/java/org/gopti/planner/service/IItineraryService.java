package org.gopti.planner.service;

import org.gopti.planner.model.ItineraryResponse;
import org.gopti.planner.model.TripRequest;

public interface IItineraryService {

    /**
     * Plans a walking itinerary. Only a malformed request fails, with
     * {@link org.gopti.planner.exception.InfeasibleInputException}; everything
     * else resolves to a plan, possibly empty, that explains every drop.
     */
    ItineraryResponse solve(TripRequest request);
}
