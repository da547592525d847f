package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.modules.stake.config.StakingProperties;
import com.slb.stake_backend.modules.stake.port.StakeAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredRoleAuthorizerTest {

    private ConfiguredRoleAuthorizer authorizer;

    @BeforeEach
    void setup() {
        StakingProperties properties = new StakingProperties();
        properties.getRoles().put("root", List.of("admin"));
        properties.getRoles().put("keeper", List.of(" SETTLE ", "pause"));
        properties.getRoles().put("nobody", List.of());
        authorizer = new ConfiguredRoleAuthorizer(properties);
    }

    @Test
    void adminRole_shouldAllowEveryAction() {
        for (StakeAction action : StakeAction.values()) {
            assertTrue(authorizer.isAuthorized("root", action), action.name());
        }
    }

    @Test
    void actionRole_shouldAllowOnlyThatAction() {
        assertTrue(authorizer.isAuthorized("keeper", StakeAction.SETTLE));
        assertTrue(authorizer.isAuthorized("keeper", StakeAction.PAUSE));
        assertFalse(authorizer.isAuthorized("keeper", StakeAction.ADD_POOL));
    }

    @Test
    void unknownOrEmpty_shouldBeDenied() {
        assertFalse(authorizer.isAuthorized("nobody", StakeAction.SETTLE));
        assertFalse(authorizer.isAuthorized("stranger", StakeAction.SETTLE));
        assertFalse(authorizer.isAuthorized(null, StakeAction.SETTLE));
    }
}
