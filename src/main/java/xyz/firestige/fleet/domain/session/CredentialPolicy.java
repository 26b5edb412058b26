package xyz.firestige.fleet.domain.session;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 操作员凭据格式校验；密码只做格式检查，不保存、不记录
 */
public final class CredentialPolicy {

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9@._\\-\\\\]{3,256}$");
    private static final int PASSWORD_MIN = 12;
    private static final int PASSWORD_MAX = 256;

    private CredentialPolicy() {
    }

    public static List<String> validate(String username, char[] password) {
        List<String> problems = new ArrayList<>();
        if (username == null || !USERNAME.matcher(username.trim()).matches()) {
            problems.add("用户名需为 3-256 位，仅允许字母、数字及 @ . _ - \\");
        }
        if (password == null || password.length < PASSWORD_MIN || password.length > PASSWORD_MAX) {
            problems.add("密码长度需为 12-256 位");
            return problems;
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean special = false;
        for (char c : password) {
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else {
                special = true;
            }
        }
        if (!(upper && lower && digit && special)) {
            problems.add("密码需同时包含大写字母、小写字母、数字和特殊字符");
        }
        return problems;
    }
}
