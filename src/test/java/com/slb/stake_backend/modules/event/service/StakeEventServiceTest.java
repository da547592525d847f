package com.slb.stake_backend.modules.event.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.common.trace.TraceIdHolder;
import com.slb.stake_backend.common.vo.PageVo;
import com.slb.stake_backend.modules.event.entity.StakeEvent;
import com.slb.stake_backend.modules.event.enums.StakeEventType;
import com.slb.stake_backend.modules.event.mapper.StakeEventMapper;
import com.slb.stake_backend.modules.event.vo.StakeEventVo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StakeEventServiceTest {

    @Mock
    private StakeEventMapper stakeEventMapper;

    @Captor
    private ArgumentCaptor<StakeEvent> eventCaptor;

    private StakeEventService stakeEventService;

    @BeforeEach
    void setup() {
        stakeEventService = new StakeEventService(stakeEventMapper, new ObjectMapper());
    }

    @AfterEach
    void cleanup() {
        TraceIdHolder.clear();
    }

    @Test
    void publish_shouldSerializeAttributesAndAttachTraceId() {
        TraceIdHolder.set("trace-1");
        StakeEvent event = StakeEvent.of(StakeEventType.DEPOSIT, 1, "alice", 120)
                .amount(BigInteger.TEN)
                .attr("stakeAmount", BigInteger.valueOf(30));

        stakeEventService.publish(event);

        verify(stakeEventMapper).insert(eventCaptor.capture());
        StakeEvent saved = eventCaptor.getValue();
        assertEquals("trace-1", saved.getTraceId());
        assertEquals("{\"stakeAmount\":\"30\"}", saved.getDetail());
    }

    @Test
    void publish_mapperFailure_shouldNotPropagate() {
        when(stakeEventMapper.insert(any())).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> stakeEventService.publish(StakeEvent.of(StakeEventType.CLAIM, 0, "bob", 150)));
    }

    @Test
    void listEvents_shouldClampPagingAndNormalizeType() {
        StakeEvent event = StakeEvent.of(StakeEventType.WITHDRAW, 2, "alice", 160).amount(BigInteger.valueOf(7));
        when(stakeEventMapper.count(2, "alice", "WITHDRAW")).thenReturn(1L);
        when(stakeEventMapper.selectPage(2, "alice", "WITHDRAW", 0, 100)).thenReturn(List.of(event));

        PageVo<StakeEventVo> page = stakeEventService.listEvents(2, " alice ", "withdraw", 0, 500);

        assertEquals(1L, page.getTotal());
        assertEquals(1, page.getPage());
        assertEquals(100, page.getSize());
        assertEquals("7", page.getList().get(0).getAmount());
        assertEquals("WITHDRAW", page.getList().get(0).getEventType());
    }

    @Test
    void listEvents_emptyCount_shouldSkipSelect() {
        when(stakeEventMapper.count(null, null, null)).thenReturn(0L);

        PageVo<StakeEventVo> page = stakeEventService.listEvents(null, "", null, 3, 20);

        assertTrue(page.getList().isEmpty());
        verify(stakeEventMapper, never()).selectPage(any(), any(), any(), anyInt(), anyInt());
    }

    @Test
    void listEvents_unknownType_shouldBeInvalid() {
        assertThrows(StakeException.class, () -> stakeEventService.listEvents(null, null, "BOGUS", 1, 20));
        verifyNoInteractions(stakeEventMapper);
    }
}
