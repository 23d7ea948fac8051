package io.mersel.services.yin.application.models;

/**
 * YIN yazdırma sonucu.
 * <p>
 * Altyapı katmanından Web katmanına dönen dahili model. Controller içeriği
 * {@code application/yin+xml} gövdesi, metadata'yı {@code X-Yin-*} header'ları olarak döner.
 */
public class PrintResult {

    private final String content;
    private final String moduleName;
    private final boolean submodule;
    private final boolean verified;
    private final long durationMs;
    private final int outputBytes;

    private PrintResult(Builder builder) {
        this.content = builder.content;
        this.moduleName = builder.moduleName;
        this.submodule = builder.submodule;
        this.verified = builder.verified;
        this.durationMs = builder.durationMs;
        this.outputBytes = builder.outputBytes;
    }

    /** YIN belgesi. */
    public String getContent() {
        return content;
    }

    public String getModuleName() {
        return moduleName;
    }

    /** Yazdırılan bir alt modül mü? */
    public boolean isSubmodule() {
        return submodule;
    }

    /** Çıktı Saxon ile ayrıştırılarak doğrulandı mı? */
    public boolean isVerified() {
        return verified;
    }

    /** İşlem süresi (milisaniye). */
    public long getDurationMs() {
        return durationMs;
    }

    /** Çıktı boyutu (UTF-8 byte). */
    public int getOutputBytes() {
        return outputBytes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String content;
        private String moduleName;
        private boolean submodule;
        private boolean verified;
        private long durationMs;
        private int outputBytes;

        private Builder() {
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder moduleName(String moduleName) {
            this.moduleName = moduleName;
            return this;
        }

        public Builder submodule(boolean submodule) {
            this.submodule = submodule;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder outputBytes(int outputBytes) {
            this.outputBytes = outputBytes;
            return this;
        }

        public PrintResult build() {
            return new PrintResult(this);
        }
    }
}
