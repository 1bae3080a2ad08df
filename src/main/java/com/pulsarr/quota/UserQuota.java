package com.pulsarr.quota;

import com.pulsarr.core.ContentType;
import com.pulsarr.exception.ConfigurationException;

/**
 * Per-user, per-content-type request cap.
 *
 * @param userId         Owner of the quota
 * @param contentType    Movies and shows are counted separately
 * @param quotaType      Counting window
 * @param quotaLimit     Accepted requests allowed per window, 0 to {@value #MAX_LIMIT}
 * @param bypassApproval Admin override: never hold this user's requests for quota reasons
 */
public record UserQuota(int userId, ContentType contentType, QuotaType quotaType, int quotaLimit,
                        boolean bypassApproval) {

    public static final int MAX_LIMIT = 1000;

    public UserQuota {
        if (contentType == null || quotaType == null) {
            throw new ConfigurationException("Quota for user " + userId + " requires a content type and quota type");
        }
        if (quotaLimit < 0 || quotaLimit > MAX_LIMIT) {
            throw new ConfigurationException("Quota limit for user " + userId + " must be between 0 and "
                    + MAX_LIMIT + ", got " + quotaLimit);
        }
    }
}
