package com.slb.stake_backend.modules.stake.port;

@FunctionalInterface
public interface Authorizer {

    boolean isAuthorized(String principal, StakeAction action);
}
