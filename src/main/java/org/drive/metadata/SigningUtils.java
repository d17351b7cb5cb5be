package org.drive.metadata;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 签名工具类：用于给分享/下载链接计算 HMAC-SHA256（十六进制字符串）。
 */
public final class SigningUtils {

    private static final HexFormat HEX = HexFormat.of();
    private static final String HMAC_SHA256 = "HmacSHA256";

    private SigningUtils() {
    }

    public static String hmacSha256Hex(byte[] secret, String message) {
        return HEX.formatHex(hmac(secret).doFinal(message.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * 常量时间比较两个十六进制签名，避免通过响应耗时猜测签名。
     */
    public static boolean signatureMatches(String expectedHex, String actualHex) {
        if (expectedHex == null || actualHex == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expectedHex.getBytes(StandardCharsets.US_ASCII),
                actualHex.getBytes(StandardCharsets.US_ASCII)
        );
    }

    private static Mac hmac(byte[] secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret, HMAC_SHA256));
            return mac;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 HmacSHA256 算法（Mac）", e);
        } catch (InvalidKeyException e) {
            throw new IllegalStateException("签名密钥不可用（app.drive.signing-secret）", e);
        }
    }
}
