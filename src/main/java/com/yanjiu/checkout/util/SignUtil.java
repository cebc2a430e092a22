package com.yanjiu.checkout.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 支付平台签名工具类
 * - 出站：为跳转支付链接的参数签名
 * - 入站：校验异步回调、同步回跳参数的签名
 *
 * 签名规则：
 * 1. 过滤空值以及 sign、sign_type 两个保留参数
 * 2. 按参数名升序排列，拼接为 key=value&key=value（不做URL编码）
 * 3. sign = md5(拼接串 + 商户密钥)，小写十六进制
 */
public final class SignUtil {

    public static final String SIGN = "sign";
    public static final String SIGN_TYPE = "sign_type";
    public static final String SIGN_TYPE_MD5 = "MD5";

    private SignUtil() {
    }

    /**
     * 构建待签名字符串
     *
     * @param params 参数（值按原样参与签名，不做类型转换）
     * @return 排序拼接后的字符串
     */
    public static String canonicalize(Map<String, String> params) {
        return new TreeMap<>(params).entrySet().stream()
                .filter(e -> !SIGN.equals(e.getKey()) && !SIGN_TYPE.equals(e.getKey()))
                .filter(e -> e.getValue() != null && !e.getValue().isEmpty())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
    }

    /**
     * 生成签名
     *
     * @param params 参数（含或不含 sign 均可，sign 不参与签名）
     * @param key 商户密钥
     * @return 小写十六进制的MD5签名
     */
    public static String sign(Map<String, String> params, String key) {
        return md5Hex(canonicalize(params) + key);
    }

    /**
     * 校验签名，缺少 sign 参数时直接判定失败
     *
     * @param params 平台回传的全部参数
     * @param key 商户密钥
     * @return 签名是否一致（区分大小写）
     */
    public static boolean verify(Map<String, String> params, String key) {
        String actual = params.get(SIGN);
        if (actual == null || actual.isEmpty()) {
            return false;
        }
        String expected = sign(params, key);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    private static String md5Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }
}
