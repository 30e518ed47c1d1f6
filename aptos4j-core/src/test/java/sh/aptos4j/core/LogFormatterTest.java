// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    private static final String HASH = "0x9e653d56a09247570bb174a389e85b9226abd5c403ea6c504b386626a145158c";

    @Test
    void http() {
        assertEquals("[HTTP] GET /v1 status=200 time=1.5ms", LogFormatter.formatHttp("GET", "/v1", 200, 1_500));
        assertEquals("[HTTP-ERROR] POST /v1/transactions error=timeout time=2.0s",
                LogFormatter.formatHttpError("POST", "/v1/transactions", "timeout", 2_000_000));
    }

    @Test
    void transactionLines() {
        assertEquals("[TX-SUBMIT] hash=0x9e65...158c time=900us", LogFormatter.formatTxSubmit(HASH, 900));
        assertEquals("[TX-BUILD] sender=0x1 seq=18446744073709551615 chain=4 maxGas=100000 gasPrice=100",
                LogFormatter.formatTxBuild("0x1", -1L, 4, 100_000, 100));
        assertEquals("[TX-RESULT] hash=0x9e65...158c success=false vmStatus=Out of gas",
                LogFormatter.formatTxResult(HASH, false, "Out of gas"));
        assertEquals("[TX-WAIT] hash=0x9e65...158c timeout=60000ms", LogFormatter.formatTxWait(HASH, 60_000));
    }

    @Test
    void shortenKeepsShortValues() {
        assertEquals("0x1", LogFormatter.shorten("0x1"));
        assertEquals("null", LogFormatter.shorten(null));
    }
}
