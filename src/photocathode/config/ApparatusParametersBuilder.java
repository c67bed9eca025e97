package photocathode.config;

/**
 * Builder для ApparatusParameters.
 * По умолчанию заполнен значениями эталонной установки (Ta-катод, 4.75 эВ).
 */
public class ApparatusParametersBuilder {

    private double tau = 10e-12;
    private double numElectrons = 1e6;
    private double workFunction = 4.25;
    private double photonEnergy = 4.75;
    private double dcField = 1e6;

    public ApparatusParametersBuilder() {
    }

    /**
     * Создать builder на основе уже существующих параметров.
     */
    public static ApparatusParametersBuilder from(ApparatusParameters base) {
        ApparatusParametersBuilder b = new ApparatusParametersBuilder();
        b.tau = base.getTau();
        b.numElectrons = base.getNumElectrons();
        b.workFunction = base.getWorkFunction();
        b.photonEnergy = base.getPhotonEnergy();
        b.dcField = base.getDcField();
        return b;
    }

    public ApparatusParameters build() {
        return new ApparatusParameters(
                tau,
                numElectrons,
                workFunction,
                photonEnergy,
                dcField
        );
    }

    // --------- геттеры/сеттеры ---------

    public double getTau() {
        return tau;
    }

    public ApparatusParametersBuilder setTau(double tau) {
        this.tau = tau;
        return this;
    }

    public double getNumElectrons() {
        return numElectrons;
    }

    public ApparatusParametersBuilder setNumElectrons(double numElectrons) {
        this.numElectrons = numElectrons;
        return this;
    }

    public double getWorkFunction() {
        return workFunction;
    }

    public ApparatusParametersBuilder setWorkFunction(double workFunction) {
        this.workFunction = workFunction;
        return this;
    }

    public double getPhotonEnergy() {
        return photonEnergy;
    }

    public ApparatusParametersBuilder setPhotonEnergy(double photonEnergy) {
        this.photonEnergy = photonEnergy;
        return this;
    }

    public double getDcField() {
        return dcField;
    }

    public ApparatusParametersBuilder setDcField(double dcField) {
        this.dcField = dcField;
        return this;
    }
}
