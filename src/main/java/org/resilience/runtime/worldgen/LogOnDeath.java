package org.resilience.runtime.worldgen;

import org.resilience.runtime.spi.DeathContext;
import org.resilience.runtime.spi.IDeathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A death handler that reports every death with the agent's position and stores at the
 * moment of death.
 */
public class LogOnDeath implements IDeathHandler {

    private static final Logger LOG = LoggerFactory.getLogger(LogOnDeath.class);

    @Override
    public void onDeath(DeathContext ctx) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        int[] pos = ctx.getPosition();
        LOG.debug("Tick={} Agent {} died at [{}, {}]: static={} dynamic={} waste={} total={} -> dynamic+={} waste+={}",
                ctx.getTick(), ctx.getAgentId(), pos[0], pos[1],
                ctx.getStaticStore(), ctx.getDynamicStore(), ctx.getWasteStore(), ctx.getTotalHoldings(),
                ctx.getRecycledToDynamic(), ctx.getRecycledToWaste());
    }
}
