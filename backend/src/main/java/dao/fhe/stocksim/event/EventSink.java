package dao.fhe.stocksim.event;

public interface EventSink {

    void emit(SimulationEvent event);
}
