package io.github.ledgersync;

import java.util.Arrays;

/**
 * JSON bodies shaped like ledger API responses.
 */
public final class LedgerFixtures {

    public static final String ACCOUNT_ID = "GBQ2ZXSGPNH5RV3CUQZBWD7WXD5RZ5E6YKCSLP5BYYEBF4DGSIV4FTF7";
    public static final String ISSUER = "GCKFBEIYTKP5RDBQMTVVALONAOPBXICILMAFIC6QKIMV6UIWUO2NNZKQ";

    private LedgerFixtures() {
    }

    public static String account(String accountId, String sequence, String nativeBalance) {
        return "{" +
                "\"id\":\"" + accountId + "\"," +
                "\"account_id\":\"" + accountId + "\"," +
                "\"sequence\":\"" + sequence + "\"," +
                "\"subentry_count\":0," +
                "\"last_modified_ledger\":" + sequence + "," +
                "\"paging_token\":\"\"," +
                "\"balances\":[{\"balance\":\"" + nativeBalance + "\",\"asset_type\":\"native\"," +
                "\"buying_liabilities\":\"0.0000000\",\"selling_liabilities\":\"0.0000000\"}]" +
                "}";
    }

    public static String effect(String pagingToken, String createdAt, String type) {
        return "{" +
                "\"id\":\"" + pagingToken + "\"," +
                "\"paging_token\":\"" + pagingToken + "\"," +
                "\"account\":\"" + ACCOUNT_ID + "\"," +
                "\"type\":\"" + type + "\"," +
                "\"created_at\":\"" + createdAt + "\"" +
                "}";
    }

    public static String transaction(String pagingToken, String createdAt) {
        return "{" +
                "\"id\":\"tx" + pagingToken + "\"," +
                "\"paging_token\":\"" + pagingToken + "\"," +
                "\"hash\":\"hash" + pagingToken + "\"," +
                "\"ledger\":" + pagingToken + "," +
                "\"created_at\":\"" + createdAt + "\"," +
                "\"source_account\":\"" + ACCOUNT_ID + "\"," +
                "\"successful\":true," +
                "\"fee_charged\":\"100\"," +
                "\"operation_count\":1," +
                "\"memo_type\":\"none\"" +
                "}";
    }

    public static String offer(String id) {
        return "{" +
                "\"id\":\"" + id + "\"," +
                "\"paging_token\":\"" + id + "\"," +
                "\"seller\":\"" + ACCOUNT_ID + "\"," +
                "\"selling\":{\"asset_type\":\"native\"}," +
                "\"buying\":{\"asset_type\":\"credit_alphanum4\",\"asset_code\":\"USD\",\"asset_issuer\":\"" + ISSUER + "\"}," +
                "\"amount\":\"10.0000000\"," +
                "\"price\":\"0.1000000\"," +
                "\"last_modified_ledger\":100" +
                "}";
    }

    public static String orderbook(String bidPrice) {
        return "{" +
                "\"bids\":[{\"price\":\"" + bidPrice + "\",\"amount\":\"100.0000000\"}]," +
                "\"asks\":[]," +
                "\"base\":{\"asset_type\":\"native\"}," +
                "\"counter\":{\"asset_type\":\"credit_alphanum4\",\"asset_code\":\"USD\",\"asset_issuer\":\"" + ISSUER + "\"}" +
                "}";
    }

    public static String page(String... records) {
        return "{" +
                "\"_links\":{\"self\":{\"href\":\"/self\"},\"next\":{\"href\":\"/next\"},\"prev\":{\"href\":\"/prev\"}}," +
                "\"_embedded\":{\"records\":[" + String.join(",", Arrays.asList(records)) + "]}" +
                "}";
    }

    public static String sse(String... payloads) {
        StringBuilder body = new StringBuilder("event: open\ndata: \"hello\"\n\n");
        for (String payload : payloads) {
            body.append("data: ").append(payload).append("\n\n");
        }
        return body.toString();
    }
}
