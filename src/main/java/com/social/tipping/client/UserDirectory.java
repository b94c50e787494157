package com.social.tipping.client;

import com.social.tipping.model.UserProfile;

import java.util.Optional;

/**
 * Looks up platform users. The directory is the only source of a user's verification tier and
 * wallet address.
 */
public interface UserDirectory {

    /**
     * @return the user's profile, empty if the directory does not know the user
     */
    Optional<UserProfile> findProfile(String userId);

    /**
     * @return E.164 phone number of a user who opted in to tip notifications
     */
    Optional<String> findNotificationNumber(String userId);
}
