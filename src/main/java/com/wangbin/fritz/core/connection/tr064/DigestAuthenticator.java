package com.wangbin.fritz.core.connection.tr064;

import com.wangbin.fritz.common.utils.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP摘要认证（RFC 2617，MD5）。
 * 收到质询后缓存nonce，后续请求直接携带认证头，nc递增。
 */
@Slf4j
public class DigestAuthenticator {

    private static final String DIGEST_PREFIX = "digest ";
    private static final Pattern PARAM_PATTERN =
            Pattern.compile("(\\w+)\\s*=\\s*(?:\"([^\"]*)\"|([^,\\s]*))");

    private final String username;
    private final String password;

    private Map<String, String> challenge;
    private int nonceCount;

    public DigestAuthenticator(String username, String password) {
        this.username = username;
        this.password = password;
    }

    public boolean hasChallenge() {
        return challenge != null;
    }

    /**
     * 处理WWW-Authenticate头，不是摘要质询时返回false
     */
    public boolean updateChallenge(String header) {
        if (header == null || !header.toLowerCase(Locale.ROOT).startsWith(DIGEST_PREFIX)) {
            return false;
        }
        Map<String, String> params = parseParams(header.substring(DIGEST_PREFIX.length()));
        if (!params.containsKey("nonce") || !params.containsKey("realm")) {
            log.warn("摘要质询缺少nonce或realm: {}", header);
            return false;
        }
        challenge = params;
        nonceCount = 0;
        return true;
    }

    /**
     * 生成Authorization头
     */
    public String authorize(String method, String uri) {
        return authorize(method, uri, CryptoUtil.randomHex(8));
    }

    String authorize(String method, String uri, String cnonce) {
        if (challenge == null) {
            throw new IllegalStateException("尚未收到摘要质询");
        }
        String realm = challenge.get("realm");
        String nonce = challenge.get("nonce");
        String qop = selectQop(challenge.get("qop"));
        String ha1 = CryptoUtil.md5(username + ":" + realm + ":" + password);
        String ha2 = CryptoUtil.md5(method + ":" + uri);

        StringBuilder header = new StringBuilder("Digest ")
                .append("username=\"").append(username).append("\", ")
                .append("realm=\"").append(realm).append("\", ")
                .append("nonce=\"").append(nonce).append("\", ")
                .append("uri=\"").append(uri).append("\", ")
                .append("algorithm=MD5, ");

        String response;
        if (qop != null) {
            String nc = String.format("%08x", ++nonceCount);
            response = CryptoUtil.md5(ha1 + ":" + nonce + ":" + nc + ":" + cnonce + ":" + qop + ":" + ha2);
            header.append("qop=").append(qop).append(", ")
                    .append("nc=").append(nc).append(", ")
                    .append("cnonce=\"").append(cnonce).append("\", ");
        } else {
            response = CryptoUtil.md5(ha1 + ":" + nonce + ":" + ha2);
        }
        header.append("response=\"").append(response).append("\"");

        String opaque = challenge.get("opaque");
        if (opaque != null) {
            header.append(", opaque=\"").append(opaque).append("\"");
        }
        return header.toString();
    }

    private static String selectQop(String offered) {
        if (offered == null) {
            return null;
        }
        for (String option : offered.split(",")) {
            if ("auth".equals(option.trim())) {
                return "auth";
            }
        }
        return null;
    }

    static Map<String, String> parseParams(String text) {
        Map<String, String> params = new HashMap<>();
        Matcher matcher = PARAM_PATTERN.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            params.put(matcher.group(1).toLowerCase(Locale.ROOT), value);
        }
        return params;
    }
}
