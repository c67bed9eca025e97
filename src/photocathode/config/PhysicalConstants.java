package photocathode.config;

/**
 * Физические константы модели фотоэмиссии (СИ).
 * Точность значений совпадает с той, на которой считались эталонные прогоны,
 * поэтому PI здесь не Math.PI.
 */
public final class PhysicalConstants {

    private PhysicalConstants() {}

    /** Число пи в точности эталонных расчётов */
    public static final double PI = 3.14159;

    /** Масса свободного электрона, кг */
    public static final double ELECTRON_MASS = 9.1E-31;

    /** Заряд электрона, Кл */
    public static final double ELECTRON_CHARGE = 1.6E-19;

    /** Постоянная Планка, делённая на 2*pi, Дж·с */
    public static final double HBAR = 6.63E-34 / (2 * PI);

    // =========================================================================
    // ======================  ЧИСЛЕННОЕ ИНТЕГРИРОВАНИЕ  =======================
    // =========================================================================

    /** Абсолютная погрешность квадратур по умолчанию */
    public static final double DEFAULT_EPS_ABS = 1e-6;

    /** Относительная погрешность квадратур по умолчанию (0 = только абсолютная) */
    public static final double DEFAULT_EPS_REL = 0.0;

    /** Число узлов Гаусса-Лежандра на одном подынтервале */
    public static final int GAUSS_POINTS = 5;

    /** Максимальное число итераций уточнения одной квадратуры */
    public static final int MAX_INTEGRATION_ITERATIONS = 64;

    /** Максимальное число вычислений подынтегральной функции на один интеграл */
    public static final int MAX_INTEGRAND_EVALUATIONS = 1_000_000;

    // =========================================================================
    // ===========================  СЕТКА МОДЕЛИ  ==============================
    // =========================================================================

    public static final int DEFAULT_NUM_SPACE_BINS = 1000;
    public static final int DEFAULT_NUM_TIME_SLICES = 1000;

    /** Длительность моделирования в единицах tau */
    public static final int DEFAULT_NUM_TAUS = 6;

    /** Показатель степени в упрощённой (быстрой) модели распределения скоростей */
    public static final double SIMPLE_MODEL_EXPONENT = 5.0;
}
