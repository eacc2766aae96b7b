package de.bsommerfeld.kurral.feed.store;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.kurral.feed.core.event.ApplicationEventBus;
import de.bsommerfeld.kurral.feed.core.event.FeedEvents.InterestsAdjustedEvent;

/**
 * Persists interest changes published by the feed service.
 */
@Singleton
public class InterestAdjustmentListener {

    private final FeedStore store;

    @Inject
    public InterestAdjustmentListener(FeedStore store, ApplicationEventBus eventBus) {
        this.store = store;
        eventBus.register(this);
    }

    @Subscribe
    public void onInterestsAdjusted(InterestsAdjustedEvent event) {
        store.applyInterestAdjustment(event.viewerId(), event.add(), event.remove());
    }
}
