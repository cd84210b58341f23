package io.sqlrpc.runtime;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sun.misc.Signal;

public final class SignalReloadTrigger {
    private static final Logger LOG = LogManager.getLogger(SignalReloadTrigger.class);
    private static final String SIGNAL = "HUP";

    private SignalReloadTrigger() {
    }

    public static boolean install(ReloadController controller) {
        try {
            Signal.handle(new Signal(SIGNAL), signal -> controller.requestReload("SIG" + SIGNAL));
            LOG.debug("Installed SIG{} reload handler", SIGNAL);
            return true;
        } catch (IllegalArgumentException | UnsupportedOperationException e) {
            LOG.warn("SIG{} is not available on this platform, reload with the CLI is disabled: {}", SIGNAL, e.getMessage());
            return false;
        }
    }
}
