package com.social.tipping.service;

import com.social.tipping.model.SettledTip;

/**
 * Side effect run after a tip settles. Failures are logged and counted, never propagated.
 */
public interface TipEnrichment {

    String getName();

    void onTipSettled(SettledTip tip);
}
