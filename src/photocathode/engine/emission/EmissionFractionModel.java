package photocathode.engine.emission;

/**
 * Модель доли электронов среза, начальные скорости которых попадают в окно.
 * Окно уже обрезано вызывающим кодом до 0 <= vLow <= vHigh <= vmax.
 */
public interface EmissionFractionModel {

    /**
     * Однократная подготовка перед раскладкой (например, расчёт нормы).
     * Вызывается до запуска рабочих потоков.
     */
    default void prepare() {
    }

    double fraction(double vLow, double vHigh);

    String name();
}
