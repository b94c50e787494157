package com.social.tipping.model;

public record QueueStats(long waiting, long active, long delayed, long completed, long failed,
                         int inFlight) {}
