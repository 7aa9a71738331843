package com.fhi.farm_breeding.controller;

/**
 * Request headers understood by the API.
 */
public final class ApiHeaders
{
    /**
     * Id of the calling user, set by the gateway after authentication. Requests without it get a 401.
     */
    public static final String USER_ID = "X-User-Id";

    private ApiHeaders()
    {}
}
