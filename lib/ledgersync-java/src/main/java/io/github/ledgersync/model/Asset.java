package io.github.ledgersync.model;

import com.google.gson.annotations.SerializedName;
import io.github.ledgersync.errors.LedgerException;

import java.util.Objects;

/**
 * Asset identifier: either the native asset or a code issued by an account.
 * <p>
 * The string form is {@code native} for the native asset and
 * {@code CODE:ISSUER} for issued assets.
 */
public final class Asset {

    /** asset type of the network's native currency */
    public static final String TYPE_NATIVE = "native";

    private static final Asset NATIVE = new Asset(TYPE_NATIVE, null, null);

    @SerializedName("asset_type")
    private final String type;

    @SerializedName("asset_code")
    private final String code;

    @SerializedName("asset_issuer")
    private final String issuer;

    private Asset(String type, String code, String issuer) {
        this.type = type;
        this.code = code;
        this.issuer = issuer;
    }

    /**
     * Returns the native asset.
     *
     * @return the native asset
     */
    public static Asset nativeAsset() {
        return NATIVE;
    }

    /**
     * Creates an issued asset. The type is derived from the code length.
     *
     * @param code   the asset code, 1 to 12 characters
     * @param issuer the issuing account id
     * @return the asset
     * @throws LedgerException if code or issuer is empty or the code is too long
     */
    public static Asset issued(String code, String issuer) {
        if (code == null || code.isEmpty() || code.length() > 12) {
            throw new LedgerException("invalid asset code: " + code);
        }
        if (issuer == null || issuer.isEmpty()) {
            throw new LedgerException("asset issuer cannot be empty");
        }
        String type = code.length() <= 4 ? "credit_alphanum4" : "credit_alphanum12";
        return new Asset(type, code, issuer);
    }

    /**
     * Parses an asset id as produced by {@link #toString()}.
     * {@code XLM} without issuer is accepted as the native asset.
     *
     * @param assetId the asset id
     * @return the asset
     * @throws LedgerException if the id is malformed
     */
    public static Asset parse(String assetId) {
        if (assetId == null || assetId.isEmpty()) {
            throw new LedgerException("asset id cannot be empty");
        }
        if (TYPE_NATIVE.equals(assetId) || "XLM".equals(assetId)) {
            return NATIVE;
        }
        int separator = assetId.indexOf(':');
        if (separator < 0) {
            throw new LedgerException("invalid asset id: " + assetId);
        }
        return issued(assetId.substring(0, separator), assetId.substring(separator + 1));
    }

    /**
     * Returns the asset type: native, credit_alphanum4 or credit_alphanum12.
     *
     * @return the type
     */
    public String getType() {
        return type;
    }

    /**
     * Returns the asset code, or null for the native asset.
     *
     * @return the code
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns the issuer account id, or null for the native asset.
     *
     * @return the issuer
     */
    public String getIssuer() {
        return issuer;
    }

    /**
     * Checks whether this is the native asset.
     *
     * @return true if native
     */
    public boolean isNative() {
        return TYPE_NATIVE.equals(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Asset asset = (Asset) o;
        return Objects.equals(type, asset.type) &&
                Objects.equals(code, asset.code) &&
                Objects.equals(issuer, asset.issuer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, code, issuer);
    }

    @Override
    public String toString() {
        return isNative() ? TYPE_NATIVE : code + ":" + issuer;
    }
}
