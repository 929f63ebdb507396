package com.fxtrader.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fxtrader.domain.model.MarketData;
import com.fxtrader.engine.TradingConfig;
import com.fxtrader.simulator.BarReplayFeed;
import com.fxtrader.simulator.SimulatorBrokerGateway;
import com.fxtrader.simulator.SimulatorConfig;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BarReplayFeedTest {

    @Mock
    private SimulatorBrokerGateway simulatorBrokerGateway;

    private SimulatorConfig simulatorConfig;
    private BarReplayFeed feed;

    @BeforeEach
    void setUp() {
        simulatorConfig = new SimulatorConfig();
        feed = new BarReplayFeed(simulatorBrokerGateway, simulatorConfig, new TradingConfig());
    }

    @Test
    void publishesBarsInFileOrder() {
        when(simulatorBrokerGateway.isConnected()).thenReturn(true);

        feed.replayNext();
        feed.replayNext();

        ArgumentCaptor<MarketData> captor = ArgumentCaptor.forClass(MarketData.class);
        verify(simulatorBrokerGateway, times(2)).publishBar(captor.capture());
        List<MarketData> bars = captor.getAllValues();
        assertThat(bars.get(0).getTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 4, 0, 0));
        assertThat(bars.get(0).getClose()).isEqualByComparingTo("1.08485");
        assertThat(bars.get(0).getSymbol()).isEqualTo("EURUSD");
        assertThat(bars.get(0).getTimeframe()).isEqualTo("H1");
        assertThat(bars.get(1).getTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 4, 1, 0));
    }

    @Test
    void malformedRowsSkipped() {
        simulatorConfig.setReplayFile("bars/malformed.csv");
        when(simulatorBrokerGateway.isConnected()).thenReturn(true);

        for (int i = 0; i < 6; i++) {
            feed.replayNext();
        }

        ArgumentCaptor<MarketData> captor = ArgumentCaptor.forClass(MarketData.class);
        verify(simulatorBrokerGateway, times(2)).publishBar(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(MarketData::getTimestamp)
                .containsExactly(LocalDateTime.of(2024, 3, 4, 0, 0), LocalDateTime.of(2024, 3, 4, 3, 0));
    }

    @Test
    void nothingPublishedWhileDisconnected() {
        when(simulatorBrokerGateway.isConnected()).thenReturn(false);

        feed.replayNext();

        verify(simulatorBrokerGateway, never()).publishBar(any());
    }

    @Test
    void blankReplayFileDisablesReplay() {
        simulatorConfig.setReplayFile("");
        when(simulatorBrokerGateway.isConnected()).thenReturn(true);

        feed.replayNext();
        feed.replayNext();

        verify(simulatorBrokerGateway, never()).publishBar(any());
    }

    @Test
    void missingReplayFileStopsReplay() {
        simulatorConfig.setReplayFile("bars/does-not-exist.csv");
        when(simulatorBrokerGateway.isConnected()).thenReturn(true);

        feed.replayNext();
        feed.replayNext();

        verify(simulatorBrokerGateway, never()).publishBar(any());
    }
}
