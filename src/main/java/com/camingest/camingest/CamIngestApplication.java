package com.camingest.camingest;

import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegLogCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CamIngestApplication {

	public static void main(String[] args) {
		// Route FFmpeg's native log through JavaCV, fatal messages only
		FFmpegLogCallback.set();
		avutil.av_log_set_level(avutil.AV_LOG_FATAL);

		SpringApplication.run(CamIngestApplication.class, args);
	}

}
