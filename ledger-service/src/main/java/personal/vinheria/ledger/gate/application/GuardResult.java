package personal.vinheria.ledger.gate.application;

import java.util.function.Function;

/**
 * Access Gate 결과
 * 세션이 유효하면 작업 결과(granted), 아니면 로그인 경로로의 리다이렉트.
 *
 * @param <T> 작업 결과 타입
 */
public final class GuardResult<T> {

    private final boolean granted;
    private final T value;
    private final String redirectPath;

    private GuardResult(boolean granted, T value, String redirectPath) {
        this.granted = granted;
        this.value = value;
        this.redirectPath = redirectPath;
    }

    public static <T> GuardResult<T> granted(T value) {
        return new GuardResult<>(true, value, null);
    }

    public static <T> GuardResult<T> redirectToLogin(String loginPath) {
        return new GuardResult<>(false, null, loginPath);
    }

    public boolean isGranted() {
        return granted;
    }

    public T value() {
        if (!granted) {
            throw new IllegalStateException("Access was not granted");
        }
        return value;
    }

    public String redirectPath() {
        if (granted) {
            throw new IllegalStateException("Access was granted, no redirect");
        }
        return redirectPath;
    }

    public <R> R fold(Function<T, R> onGranted, Function<String, R> onRedirect) {
        return granted ? onGranted.apply(value) : onRedirect.apply(redirectPath);
    }
}
