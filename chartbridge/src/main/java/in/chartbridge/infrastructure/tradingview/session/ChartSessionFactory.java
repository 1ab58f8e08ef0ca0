package in.chartbridge.infrastructure.tradingview.session;

import in.chartbridge.infrastructure.tradingview.protocol.TvCommands;
import in.chartbridge.infrastructure.tradingview.protocol.TvMessageParser;
import in.chartbridge.infrastructure.tradingview.transport.TransportFactory;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires a new transport, the shared codec helpers and the observer into each session.
 */
public class ChartSessionFactory implements SessionFactory {

    private final TransportFactory transportFactory;
    private final TvMessageParser parser;
    private final TvCommands commands;
    private final SessionTimeouts timeouts;
    private final SessionObserver observer;
    private final ScheduledExecutorService scheduler;

    public ChartSessionFactory(TransportFactory transportFactory,
                               TvMessageParser parser,
                               TvCommands commands,
                               SessionTimeouts timeouts,
                               SessionObserver observer,
                               ScheduledExecutorService scheduler) {
        this.transportFactory = transportFactory;
        this.parser = parser;
        this.commands = commands;
        this.timeouts = timeouts;
        this.observer = observer;
        this.scheduler = scheduler;
    }

    @Override
    public ChartSession create(String connectionId) {
        return new ChartSession(connectionId, transportFactory.create(connectionId),
            parser, commands, timeouts, observer, scheduler);
    }
}
