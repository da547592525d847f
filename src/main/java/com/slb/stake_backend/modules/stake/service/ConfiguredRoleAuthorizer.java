package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.modules.stake.config.StakingProperties;
import com.slb.stake_backend.modules.stake.port.Authorizer;
import com.slb.stake_backend.modules.stake.port.StakeAction;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ConfiguredRoleAuthorizer implements Authorizer {

    public static final String ADMIN_ROLE = "ADMIN";

    private final StakingProperties properties;

    public ConfiguredRoleAuthorizer(StakingProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean isAuthorized(String principal, StakeAction action) {
        if (principal == null) {
            return false;
        }
        List<String> roles = properties.getRoles().get(principal);
        if (roles == null || roles.isEmpty()) {
            return false;
        }
        for (String role : roles) {
            if (role == null) {
                continue;
            }
            String normalized = role.trim();
            if (ADMIN_ROLE.equalsIgnoreCase(normalized) || action.name().equalsIgnoreCase(normalized)) {
                return true;
            }
        }
        return false;
    }
}
