package mmc;

interface Schedulable {
    void fire(Engine anEngine);
}
