package com.relaybot.stocks;

import java.util.Optional;

public interface QuoteProvider {

    /**
     * Looks up the current quote for a symbol.
     *
     * @return empty when the provider has no record of the symbol
     * @throws QuoteException on network failure or an unusable response
     */
    Optional<QuoteSnapshot> lookup(String symbol);
}
